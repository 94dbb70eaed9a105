/** Use cases of the gateway that combine the auth core with persistence and audit. */
package com.ariia.authgateway.application;

/** REST endpoints and their request and response bodies. */
package com.ariia.authgateway.api;

/** Redis adapters for the auth core. */
package com.ariia.authgateway.infrastructure.redis;

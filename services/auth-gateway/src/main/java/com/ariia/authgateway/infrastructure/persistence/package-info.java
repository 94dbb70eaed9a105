/** JDBC adapters over the auth schema. */
package com.ariia.authgateway.infrastructure.persistence;

/** HTTP plumbing: correlation, credentials, cookies and error mapping. */
package com.ariia.authgateway.infrastructure.web;

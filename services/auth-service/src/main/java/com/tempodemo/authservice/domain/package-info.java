/**
 * Authorization domain: the credential store port and the Basic-auth decision it feeds.
 *
 * <p>Nothing in this package knows about Envoy messages or JDBC.
 */
package com.tempodemo.authservice.domain;

/**
 * HTTP front end of SOAR Sentinel: environment-driven configuration, the
 * JSON API over the JDK {@code HttpServer}, the outbound webhook notifier
 * and the process entry point.
 */
package com.soarsentinel.server;

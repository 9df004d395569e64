/**
 * Fire-and-forget notification of alerts and actions.
 */
package com.soarsentinel.core.notify;

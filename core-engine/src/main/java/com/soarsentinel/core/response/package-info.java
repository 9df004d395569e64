/**
 * Playbook execution and operator-driven defensive actions.
 */
package com.soarsentinel.core.response;

/**
 * Detection rule configuration.
 *
 * <p>
 * Rules are tuned in YAML and loaded by
 * {@link com.soarsentinel.core.config.RulesLoader} into a
 * {@link com.soarsentinel.core.config.RulesConfig}. Validation runs right
 * after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.soarsentinel.core.config;

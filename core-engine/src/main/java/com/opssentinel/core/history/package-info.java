/**
 * Per-metric bounded history of observed values, the baseline every
 * detector scores a fresh snapshot against.
 *
 * @since 1.0.0
 */
package com.opssentinel.core.history;

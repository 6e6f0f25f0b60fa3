/**
 * Control surface exposed to API layers.
 *
 * @since 1.0.0
 */
package com.opssentinel.core.control;

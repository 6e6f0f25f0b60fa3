/**
 * Interfaces of the external collaborators: the metrics source, the audit
 * store and the notification sink.
 *
 * @since 1.0.0
 */
package com.opssentinel.core.spi;

/**
 * Automated response: handlers that propose remediation actions, the engine
 * that validates, executes, gates and rolls them back, and the approval
 * gateway holding actions that wait for human sign-off.
 *
 * @since 1.0.0
 */
package com.opssentinel.core.response;

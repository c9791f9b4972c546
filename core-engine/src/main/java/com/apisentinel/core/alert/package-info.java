/**
 * Alert persistence and lifecycle.
 *
 * <p>
 * {@link com.apisentinel.core.alert.AlertLifecycleManager} enforces the
 * lifecycle rules over any {@link com.apisentinel.core.alert.AlertStore}
 * backend and publishes changes to listeners.
 * </p>
 */
package com.apisentinel.core.alert;

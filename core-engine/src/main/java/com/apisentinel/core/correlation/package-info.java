/**
 * Multi-signal corroboration and alert debouncing per endpoint.
 */
package com.apisentinel.core.correlation;

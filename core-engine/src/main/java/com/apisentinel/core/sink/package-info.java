/**
 * Alert notification delivery: sinks, severity routing, cool-downs and
 * retries.
 */
package com.apisentinel.core.sink;

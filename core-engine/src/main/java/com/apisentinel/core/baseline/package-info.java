/**
 * Storage of per-metric EWMA baselines.
 */
package com.apisentinel.core.baseline;

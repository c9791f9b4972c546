/**
 * Natural-language explanations and severity of alerts, driven by data rules.
 */
package com.apisentinel.core.explain;

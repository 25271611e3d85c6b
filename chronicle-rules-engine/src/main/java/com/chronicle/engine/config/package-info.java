/**
 * Environment-driven engine settings.
 */
package com.chronicle.engine.config;

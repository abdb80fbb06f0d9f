/**
 * In-memory record store and ingestion errors.
 *
 * @since 1.0.0
 */
package com.thermosentinel.core.store;

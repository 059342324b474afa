/**
 * In-memory connectivity event bus.
 *
 * @since 1.0.0
 * @author CloudCall Team
 */
package com.ryuqq.cloudcall.adapter.inmemory.bus;

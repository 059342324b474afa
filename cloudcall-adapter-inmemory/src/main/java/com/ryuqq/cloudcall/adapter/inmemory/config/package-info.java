/**
 * In-memory configuration sources.
 *
 * @since 1.0.0
 * @author CloudCall Team
 */
package com.ryuqq.cloudcall.adapter.inmemory.config;

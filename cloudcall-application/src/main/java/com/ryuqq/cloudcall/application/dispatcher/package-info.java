/**
 * Public call API of the engine.
 *
 * @since 1.0.0
 * @author CloudCall Team
 */
package com.ryuqq.cloudcall.application.dispatcher;

/**
 * Collaborator SPIs of the call engine.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cloudcall.core.spi.Transport} - performs one remote call</li>
 *   <li>{@link com.ryuqq.cloudcall.core.spi.ConnectivityEvents} - connectivity change notifications</li>
 *   <li>{@link com.ryuqq.cloudcall.core.spi.ConnectivityRecovery} - resolves a declared timeout</li>
 *   <li>{@link com.ryuqq.cloudcall.core.spi.LoadingIndicator} - claim-based spinner</li>
 *   <li>{@link com.ryuqq.cloudcall.core.spi.AppStateSink} - app-state hydration from responses</li>
 *   <li>{@link com.ryuqq.cloudcall.core.spi.TimeoutSettingsSource} - deadline configuration</li>
 * </ul>
 *
 * <p>Implementations live in adapter modules or in the host application.</p>
 *
 * @author CloudCall Team
 * @since 1.0.0
 */
package com.ryuqq.cloudcall.core.spi;

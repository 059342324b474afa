/**
 * Contract test infrastructure for the call engine.
 *
 * <p>Scripted collaborators plus {@link com.ryuqq.cloudcall.testkit.contract.AbstractEngineContractTest},
 * which runs the engine on a driven tick scheduler so timing scenarios are deterministic.</p>
 *
 * @since 1.0.0
 * @author CloudCall Team
 */
package com.ryuqq.cloudcall.testkit.contract;

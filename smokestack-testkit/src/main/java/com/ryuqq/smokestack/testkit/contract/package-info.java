/**
 * Contract test infrastructure for the coordination engine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.smokestack.testkit.contract.AbstractEngineContractTest} - fresh engine per test plus helpers</li>
 *   <li>{@link com.ryuqq.smokestack.testkit.contract.RecordingBroadcaster} - records every published operation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Smokestack Team
 */
package com.ryuqq.smokestack.testkit.contract;

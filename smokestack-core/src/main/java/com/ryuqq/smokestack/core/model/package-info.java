/**
 * Domain model of the coordination engine.
 *
 * <p>All entities are immutable records. The engine replaces stored instances on every
 * committed write, so a reference handed to a reader or a subscriber never changes.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.smokestack.core.model.User} - authenticated user owning a {@link com.ryuqq.smokestack.core.model.SubscriptionSet}</li>
 *   <li>{@link com.ryuqq.smokestack.core.model.Component} - shared resource touched by operations</li>
 *   <li>{@link com.ryuqq.smokestack.core.model.Tag} - operation label</li>
 *   <li>{@link com.ryuqq.smokestack.core.model.Operation} - tracked unit of change work</li>
 *   <li>{@link com.ryuqq.smokestack.core.model.OperationFilter} - list query</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Smokestack Team
 */
package com.ryuqq.smokestack.core.model;

/**
 * Component lock coordinator.
 *
 * <p>{@link com.ryuqq.smokestack.core.lock.LockTable} arbitrates per-component access so that a
 * component is held either by exactly one EXCLUSIVE holder or by any number of SHARED holders,
 * never a mix. {@link com.ryuqq.smokestack.core.lock.LockRequirements} derives what an active
 * operation must hold.</p>
 *
 * <p>The table is not thread-safe on purpose: the engine mutates it only while holding its
 * single write lock, together with the entity store.</p>
 *
 * @since 1.0.0
 * @author Smokestack Team
 */
package com.ryuqq.smokestack.core.lock;

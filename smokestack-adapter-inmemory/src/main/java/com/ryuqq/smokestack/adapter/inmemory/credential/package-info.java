/**
 * In-memory bearer credential store.
 *
 * @since 1.0.0
 * @author Smokestack Team
 */
package com.ryuqq.smokestack.adapter.inmemory.credential;

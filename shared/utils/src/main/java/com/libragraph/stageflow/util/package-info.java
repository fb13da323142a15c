/**
 * Shared utilities for all Stageflow modules.
 *
 * <p>Contains {@link com.libragraph.stageflow.util.Backoff}, the retry delay
 * arithmetic used when a failed stage is put back on its queue.
 * No framework dependencies, pure Java.
 */
package com.libragraph.stageflow.util;

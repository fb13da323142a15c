/**
 * Closed status vocabularies shared across all Stageflow modules.
 *
 * <p>Enums that are persisted carry a stable numeric id (stored as smallint)
 * and a lower-case label used on the wire. This module has no dependencies.
 */
package com.libragraph.stageflow.types;

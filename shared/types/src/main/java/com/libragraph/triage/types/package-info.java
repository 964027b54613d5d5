/**
 * Pure Java value types shared across all triage modules.
 *
 * <p>Buffer types and binary helpers live in {@code shared/utils}.
 * This module has no dependencies.
 */
package com.libragraph.triage.types;

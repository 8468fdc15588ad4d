/* (C)2026 Macstab GmbH */

/**
 * Route label resolution: matched route templates, per-request cardinality overrides and
 * placeholder rendering.
 *
 * @since 1.0.0
 */
package com.macstab.oss.http.metrics.route;

/**
 * Audit records for resolutions. Stores implement {@link com.chronicle.resolution.ledger.ResolutionLedger};
 * the pipeline only talks to the fail-safe {@link com.chronicle.resolution.ledger.ResolutionAuditTrail}.
 */
package com.chronicle.resolution.ledger;

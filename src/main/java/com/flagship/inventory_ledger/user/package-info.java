/**
 * Minimal user directory used to resolve notification recipients.
 */
package com.flagship.inventory_ledger.user;

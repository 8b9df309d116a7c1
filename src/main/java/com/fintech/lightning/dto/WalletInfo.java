package com.fintech.lightning.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Point-in-time balance snapshot, in the smallest currency unit the backend reports.
 */
@Value
@Builder
@Jacksonized
public class WalletInfo {

    long balance;
}

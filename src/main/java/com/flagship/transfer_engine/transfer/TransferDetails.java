package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.approval.Approval;
import lombok.Value;

import java.util.UUID;

/**
 * A transfer joined with the display data of both accounts and, when it required
 * approval, its approval record.
 */
@Value
public class TransferDetails {
    Transfer transfer;
    AccountSummary fromAccount;
    AccountSummary toAccount;
    Approval approval;

    @Value
    public static class AccountSummary {
        UUID id;
        String accountNumber;
        String accountName;
    }
}

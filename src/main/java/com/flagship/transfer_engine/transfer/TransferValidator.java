package com.flagship.transfer_engine.transfer;

import com.flagship.transfer_engine.account.AccountRepository;
import com.flagship.transfer_engine.transfer.exception.TransferValidationException;
import com.flagship.transfer_engine.transfer.exception.ValidationFailure;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Go/no-go decision for a proposed transfer.
 *
 * Order is fixed and short-circuits on the first failure:
 * amount, same account, source balance, destination existence.
 */
@Component
@RequiredArgsConstructor
public class TransferValidator {

    private static final int MAX_AMOUNT_SCALE = 2;

    private final BalanceValidator balanceValidator;
    private final AccountRepository accountRepository;

    public void validate(UUID fromAccountId, UUID toAccountId, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new TransferValidationException(ValidationFailure.INVALID_AMOUNT,
                    "Amount must be greater than 0");
        }
        if (amount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
            throw new TransferValidationException(ValidationFailure.INVALID_AMOUNT,
                    "Amount cannot have more than " + MAX_AMOUNT_SCALE + " decimal places");
        }
        if (fromAccountId != null && fromAccountId.equals(toAccountId)) {
            throw new TransferValidationException(ValidationFailure.SAME_ACCOUNT,
                    "Cannot transfer to the same account");
        }

        balanceValidator.check(fromAccountId, toAccountId, amount);

        if (toAccountId == null || accountRepository.findActiveById(toAccountId).isEmpty()) {
            throw new TransferValidationException(ValidationFailure.ACCOUNT_NOT_FOUND,
                    "Destination account not found or inactive");
        }
    }
}

package com.flagship.group_ledger.split;

import com.flagship.group_ledger.error.Outcome;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Equal split with remainder units going to the first participants.
 */
@RequiredArgsConstructor
public class EqualSplitPolicy implements SplitPolicy {

    public static final String NAME = "EQUAL";

    private final SplitCalculator calculator;

    @Override
    public Outcome<List<SplitShare>> computeShares(long amount, List<String> participants) {
        return calculator.split(amount, participants);
    }

    @Override
    public String name() {
        return NAME;
    }
}

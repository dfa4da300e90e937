package com.example.ledger;

import java.util.ArrayList;
import java.util.List;

public class Ledger {

    private final List<Long> entries = new ArrayList<>();
    private long balance;

    public void post(long amount) {
        if (amount == 0) {
            throw new IllegalArgumentException("empty entry");
        }
        entries.add(amount);
        balance += amount;
    }

    public long balance() {
        return balance;
    }

    public int countDebits() {
        int debits = 0;
        for (long entry : entries) {
            if (entry < 0) {
                debits++;
            }
        }
        return debits;
    }

    public String describe(int level) {
        String label;
        switch (level) {
            case 0:
                label = "none";
                break;
            case 1:
                label = "low";
                break;
            default:
                label = "high";
        }
        try {
            post(level);
        } catch (IllegalArgumentException e) {
            label = label + "!";
        } finally {
            entries.clear();
        }
        return label;
    }
}

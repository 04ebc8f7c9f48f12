package com.example.musiccurator.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class GroupValidation {

    private int groupId;

    private List<ValidationCheck> checks = new ArrayList<>();

    public boolean isPassed() {
        for (ValidationCheck check : checks) {
            if (check.blocking()) {
                return false;
            }
        }
        return true;
    }

    public List<String> failureMessages() {
        List<String> messages = new ArrayList<>();
        for (ValidationCheck check : checks) {
            if (check.blocking()) {
                messages.add(check.getName() + ": " + check.getMessage());
            }
        }
        return messages;
    }
}

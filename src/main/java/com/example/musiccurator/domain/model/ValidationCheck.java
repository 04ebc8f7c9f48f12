package com.example.musiccurator.domain.model;

import com.example.musiccurator.domain.enumtype.CheckLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationCheck {

    private int checkpoint;

    private String name;

    private CheckLevel level;

    private boolean passed;

    private String message;

    /**
     * Only a failed ERROR-level check excludes a group.
     */
    public boolean blocking() {
        return !passed && level == CheckLevel.ERROR;
    }
}

package com.example.musiccurator.api.request;

import com.example.musiccurator.domain.enumtype.CleanupMode;
import lombok.Data;

@Data
public class CreateCleanupPlanRequest {

    private CleanupMode mode;
}

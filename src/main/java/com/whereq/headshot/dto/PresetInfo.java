package com.whereq.headshot.dto;

import com.whereq.headshot.model.JobPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresetInfo {
    private String name;
    private List<String> styles;
    private int outputsPerStyle;
    private int totalOutputs;
    private int estimatedTimeMinutes;
    private JobPriority priority;
}

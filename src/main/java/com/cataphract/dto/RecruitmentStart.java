package com.cataphract.dto;

import com.cataphract.model.Army;
import com.cataphract.model.RecruitmentProject;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A newly started muster plus any rebel armies spawned by recruitment revolts.
 */
@Data
@Builder
public class RecruitmentStart {
    private RecruitmentProject project;
    @Builder.Default
    private List<Army> revolts = new ArrayList<>();
    private String detail;
}

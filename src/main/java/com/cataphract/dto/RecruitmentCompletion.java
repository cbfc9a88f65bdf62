package com.cataphract.dto;

import com.cataphract.model.Army;

public record RecruitmentCompletion(Army army, String detail) {
}

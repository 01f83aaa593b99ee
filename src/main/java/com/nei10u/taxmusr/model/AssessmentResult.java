package com.nei10u.taxmusr.model;

/**
 * 两种申报方式的比较结果。
 *
 * @param advantage individual - joint，正数表示合并申报可节省的金额
 */
public record AssessmentResult(double individualTotal,
                               double jointTotal,
                               double advantage,
                               Recommendation recommendation) {
}

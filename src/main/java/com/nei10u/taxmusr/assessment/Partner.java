package com.nei10u.taxmusr.assessment;

public enum Partner {
    A,
    B
}

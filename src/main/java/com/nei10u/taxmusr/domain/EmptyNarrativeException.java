package com.nei10u.taxmusr.domain;

public class EmptyNarrativeException extends IllegalStateException {

    public EmptyNarrativeException(String domain) {
        super("[" + domain + "] 叙事生成返回空文本");
    }
}

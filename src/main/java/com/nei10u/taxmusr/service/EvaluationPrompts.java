package com.nei10u.taxmusr.service;

final class EvaluationPrompts {

    static final String EVALUATION = """
            You are a tax expert in Germany. Given a story, answer the question at the end.

            {examples}

            STORY:
            {narrative}

            QUESTION:
            {question}

            Pick one of the following choices: {options}.
            You must pick one option.
            {cot}
            Finally, the last thing you generate should be "ANSWER: (your answer here)".
            """;

    static final String COT_INSTRUCTION = "Explain your reasoning step by step before you answer.";

    private EvaluationPrompts() {
    }
}

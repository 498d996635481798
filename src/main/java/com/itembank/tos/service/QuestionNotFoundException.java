package com.itembank.tos.service;

public class QuestionNotFoundException extends RuntimeException {
    public QuestionNotFoundException(String questionId) {
        super("Question not found: " + questionId);
    }
}

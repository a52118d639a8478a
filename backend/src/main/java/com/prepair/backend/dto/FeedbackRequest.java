package com.prepair.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackRequest {

    @NotNull
    private Long questionId;

    @NotBlank
    @Size(max = InputLimits.MAX_QUESTION_LENGTH)
    private String question;

    @NotBlank
    @Size(max = InputLimits.MAX_ANSWER_LENGTH)
    private String answer;
}

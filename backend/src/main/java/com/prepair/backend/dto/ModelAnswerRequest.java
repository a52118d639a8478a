package com.prepair.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelAnswerRequest {

    @NotBlank
    @Size(max = InputLimits.MAX_QUESTION_LENGTH)
    private String question;
}

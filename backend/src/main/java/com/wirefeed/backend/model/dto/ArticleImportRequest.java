package com.wirefeed.backend.model.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArticleImportRequest {
    public static final int MAX_BATCH_SIZE = 100;

    @NotEmpty
    @Size(max = MAX_BATCH_SIZE)
    @Valid
    private List<ArticleImportDTO> articles;
}

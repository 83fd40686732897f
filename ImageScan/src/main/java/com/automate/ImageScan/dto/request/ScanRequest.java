package com.automate.ImageScan.dto.request;

import com.automate.ImageScan.util.ImageReferences;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ScanRequest {

    @NotBlank(message = "Image name is required")
    @Size(max = ImageReferences.MAX_LENGTH, message = "Image name must be at most 512 characters")
    private String image;
}

package com.hrsynth.api.controller;

import com.hrsynth.api.model.ApiResponse;
import com.hrsynth.api.model.DataTable;
import com.hrsynth.api.model.GenerateHrDataInput;
import com.hrsynth.api.model.HrDataset;
import com.hrsynth.api.service.HrDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/hr-data")
@Tag(name = "HR Data Generation", description = "APIs for generating synthetic HR datasets")
public class HrDataController implements IHrDataController<GenerateHrDataInput> {

  private final HrDataService hrDataService;

  @Override
  @PostMapping()
  @Operation(summary = "Generate a synthetic HR dataset")
  public ResponseEntity<ApiResponse<Map<String, DataTable<?>>>> generate(
      @Parameter(description = "Generation parameters", required = true) @RequestBody @Valid
          GenerateHrDataInput input) {
    HrDataset dataset = hrDataService.generate(input.toRequest());
    log.debug("Returning {} tables for seed {}", dataset.tables().size(), dataset.seed());
    return ResponseEntity.ok()
        .header("X-Generation-Seed", Long.toString(dataset.seed()))
        .body(ApiResponse.success(dataset.tables()));
  }

  @Override
  @GetMapping("/reference")
  @Operation(summary = "Get the reference tables used for generation")
  public ResponseEntity<ApiResponse<Map<String, DataTable<?>>>> getReferenceTables() {
    return ResponseEntity.ok(ApiResponse.success(hrDataService.getReferenceCatalog().tables()));
  }
}

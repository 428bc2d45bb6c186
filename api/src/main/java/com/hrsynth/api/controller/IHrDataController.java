package com.hrsynth.api.controller;

import com.hrsynth.api.model.ApiResponse;
import com.hrsynth.api.model.DataTable;
import java.util.Map;
import org.springframework.http.ResponseEntity;

public interface IHrDataController<I> {

  ResponseEntity<ApiResponse<Map<String, DataTable<?>>>> generate(I input);

  ResponseEntity<ApiResponse<Map<String, DataTable<?>>>> getReferenceTables();
}

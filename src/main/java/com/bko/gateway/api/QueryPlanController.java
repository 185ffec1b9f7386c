package com.bko.gateway.api;

import com.bko.gateway.execution.PlanExecutionService;
import com.bko.gateway.execution.model.ExecutionResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/query-plan")
public class QueryPlanController {

    private final PlanExecutionService planExecutionService;

    public QueryPlanController(PlanExecutionService planExecutionService) {
        this.planExecutionService = planExecutionService;
    }

    @PostMapping("/execute")
    public ExecutionResponse execute(@Valid @RequestBody ExecutePlanRequest request) {
        return planExecutionService.execute(request.plan(), request.query(), request.operationName(),
                request.variables());
    }
}

package com.aina.backend.llm.orchestration;

import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.model.InvocationRequest;
import com.aina.backend.llm.model.InvocationResult;

/** Issues one direct provider call on behalf of an orchestrator. */
@FunctionalInterface
public interface SubCallInvoker {

  InvocationResult invoke(ModelDescriptor target, InvocationRequest request);
}

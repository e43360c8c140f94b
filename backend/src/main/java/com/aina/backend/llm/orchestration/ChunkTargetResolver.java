package com.aina.backend.llm.orchestration;

import com.aina.backend.llm.config.ContextWindowProperties;
import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.descriptor.ModelDescriptorTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/** Picks the provider that serves chunk sub-calls for a requested provider. */
@Slf4j
public class ChunkTargetResolver {

  private final ModelDescriptorTable descriptors;
  private final ContextWindowProperties properties;

  public ChunkTargetResolver(ModelDescriptorTable descriptors, ContextWindowProperties properties) {
    this.descriptors = descriptors;
    this.properties = properties;
  }

  public ModelDescriptor resolve(ModelDescriptor requested) {
    if (requested.mapReduceCapable() || !StringUtils.hasText(properties.getMapReduceProvider())) {
      return requested;
    }
    ModelDescriptor substitute = descriptors.require(properties.getMapReduceProvider());
    log.info(
        "Provider {} does not serve chunk sub-calls, using {}",
        requested.providerId(),
        substitute.providerId());
    return substitute;
  }
}

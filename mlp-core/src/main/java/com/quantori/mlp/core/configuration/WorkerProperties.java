package com.quantori.mlp.core.configuration;

import java.time.Duration;
import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class WorkerProperties {
  String systemName;
  int inlineAtomLimit;
  Duration askTimeout;
}

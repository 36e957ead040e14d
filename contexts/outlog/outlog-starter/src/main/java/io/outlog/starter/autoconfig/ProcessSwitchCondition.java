package io.outlog.starter.autoconfig;

import io.outlog.domain.config.EnvironmentSwitch;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/** Matches unless {@value EnvironmentSwitch#VARIABLE} turns interception off. */
class ProcessSwitchCondition extends SpringBootCondition {

  @Override
  public ConditionOutcome getMatchOutcome(
      ConditionContext context, AnnotatedTypeMetadata metadata) {
    String raw = context.getEnvironment().getProperty(EnvironmentSwitch.VARIABLE);
    if (EnvironmentSwitch.isEnabled(raw)) {
      return ConditionOutcome.match(EnvironmentSwitch.VARIABLE + " allows interception");
    }
    return ConditionOutcome.noMatch(EnvironmentSwitch.VARIABLE + "=" + raw);
  }
}

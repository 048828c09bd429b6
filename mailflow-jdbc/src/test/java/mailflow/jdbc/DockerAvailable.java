package mailflow.jdbc;

import org.junit.jupiter.api.extension.ConditionEvaluationResult;
import org.junit.jupiter.api.extension.ExecutionCondition;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.testcontainers.DockerClientFactory;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Runs the PostgreSQL and MySQL store suites only where Testcontainers can reach a Docker
 * daemon; elsewhere they are reported as skipped and the H2 suite covers the shared store
 * behaviour.
 */
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@ExtendWith(DockerAvailable.DockerCondition.class)
@interface DockerAvailable {

  class DockerCondition implements ExecutionCondition {
    @Override
    public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
      if (DockerClientFactory.instance().isDockerAvailable()) {
        return ConditionEvaluationResult.enabled("Docker daemon reachable");
      }
      return ConditionEvaluationResult.disabled(
          "No Docker daemon; skipping " + context.getDisplayName() + " store tests");
    }
  }
}

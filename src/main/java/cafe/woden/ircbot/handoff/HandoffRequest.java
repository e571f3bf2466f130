package cafe.woden.ircbot.handoff;

import java.util.List;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A child process to start. {@code inheritedDescriptors.get(i)} ends up at descriptor
 * {@code 3 + i} in the child.
 */
@ValueObject
public record HandoffRequest(List<String> childArgv, List<Integer> inheritedDescriptors) {

  public HandoffRequest {
    childArgv = List.copyOf(childArgv);
    inheritedDescriptors = List.copyOf(inheritedDescriptors);
    if (childArgv.isEmpty()) throw new IllegalArgumentException("childArgv is empty");
  }
}

package mailflow.model;

import java.util.List;

/**
 * Outcome of a bulk registration.
 *
 * @param created    rows inserted by this call
 * @param duplicates recipients already registered, or repeated within the batch
 * @param errors     recipients rejected by validation or a failed write
 * @param details    one entry for every recipient that was not created
 * @param createdKeys job keys of the rows this call inserted
 */
public record RegistrationResult(
    int created,
    int duplicates,
    int errors,
    List<RegistrationDetail> details,
    List<String> createdKeys
) {

  public RegistrationResult {
    details = List.copyOf(details);
    createdKeys = List.copyOf(createdKeys);
  }
}

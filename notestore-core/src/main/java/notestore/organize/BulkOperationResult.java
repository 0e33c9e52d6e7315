package notestore.organize;

import java.util.List;

public record BulkOperationResult(boolean success, int processedCount, List<String> errors) {

  public BulkOperationResult {
    errors = List.copyOf(errors);
  }

  static BulkOperationResult of(int processedCount, List<String> errors) {
    return new BulkOperationResult(errors.isEmpty(), processedCount, errors);
  }
}

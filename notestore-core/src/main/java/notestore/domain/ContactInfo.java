package notestore.domain;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record ContactInfo(
    @Email @Size(max = 320) String email,
    @Pattern(regexp = Constraints.PHONE) String phone,
    Map<@Pattern(regexp = Constraints.SOCIAL_PLATFORM) String, @Size(max = 100) String> social,
    @Size(max = 500) String address
) {

  public ContactInfo {
    social = social == null ? Map.of() : Map.copyOf(social);
  }

  public static ContactInfo email(String email) {
    return new ContactInfo(email, null, null, null);
  }

  public static ContactInfo empty() {
    return new ContactInfo(null, null, null, null);
  }
}

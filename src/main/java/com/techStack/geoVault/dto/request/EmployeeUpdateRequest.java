package com.techStack.geoVault.dto.request;

import jakarta.validation.constraints.Email;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Only these fields can be changed on an employee; anything else in the request body is ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmployeeUpdateRequest {

    @Email(message = "Invalid email format")
    private String email;

    private String password;

    private Boolean active;

    @Override
    public String toString() {
        return "EmployeeUpdateRequest{email=" + (email != null) + ", password=" + (password != null)
                + ", active=" + active + "}";
    }
}

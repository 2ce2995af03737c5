package com.koni.ems.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.koni.ems.domain.register.RegisterDataType;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One entry of a device register map: which holding register carries a parameter
 * and how its words are encoded.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegisterMapping {

    private String parameter;
    private int address;
    private RegisterDataType dataType;
    private String description;

    /**
     * Number of registers for variable-length types; {@code null} means the type default.
     */
    private Integer registerCount;

    public RegisterMapping(String parameter, int address, RegisterDataType dataType, String description) {
        this(parameter, address, dataType, description, null);
    }

    @JsonIgnore
    public int effectiveRegisterCount() {
        if (registerCount != null && dataType != null && dataType.hasVariableLength()) {
            return registerCount;
        }
        return dataType == null ? 1 : dataType.getRegisterCount();
    }
}

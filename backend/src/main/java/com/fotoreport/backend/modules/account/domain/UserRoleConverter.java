package com.fotoreport.backend.modules.account.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class UserRoleConverter implements AttributeConverter<UserRole, String> {

    @Override
    public String convertToDatabaseColumn(UserRole role) {
        return role != null ? role.getCode() : null;
    }

    @Override
    public UserRole convertToEntityAttribute(String code) {
        return code != null ? UserRole.fromCode(code) : null;
    }
}

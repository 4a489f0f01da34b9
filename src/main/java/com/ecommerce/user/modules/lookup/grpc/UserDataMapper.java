package com.ecommerce.user.modules.lookup.grpc;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

import com.ecommerce.user.modules.account.domain.UserAccount;
import com.ecommerce.user.proto.UserData;

/**
 * Maps accounts onto the wire message. Protobuf strings cannot be null, so unset text becomes "".
 */
final class UserDataMapper {

    private UserDataMapper() {
    }

    static UserData toProto(UserAccount user) {
        return UserData.newBuilder()
                .setId(user.getId() != null ? user.getId().toString() : "")
                .setEmail(nullToEmpty(user.getEmail()))
                .setUsername(nullToEmpty(user.getUsername()))
                .setFirstName(nullToEmpty(user.getFirstName()))
                .setLastName(nullToEmpty(user.getLastName()))
                .setPhoneNumber(nullToEmpty(user.getPhoneNumber()))
                .setIsActive(user.isActive())
                .setIsVerified(user.isVerified())
                .setDateJoined(formatTimestamp(user.getCreatedAt()))
                .build();
    }

    private static String formatTimestamp(OffsetDateTime value) {
        return value != null ? DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(value) : "";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}

package com.placement.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MongoDB document for a canonical placement record.
 *
 * Roles and students are stored as arrays: role names and enrollment numbers may contain
 * '.' or '$', which are not safe as Mongo map keys. {@code company} is indexed but not
 * unique; concurrent first inserts can leave duplicates behind.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "placement_offers")
public class PlacementDocument {

    @Id
    private String id;

    @Indexed
    private String company;

    private List<RoleEntry> roles;

    @Field("students_selected")
    private List<StudentEntry> studentsSelected;

    @Field("number_of_offers")
    private int numberOfOffers;

    @Field("created_at")
    private Instant createdAt;

    @Indexed
    @Field("updated_at")
    private Instant updatedAt;

    private long version;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RoleEntry {
        private String role;
        @Field("package")
        private BigDecimal packageValue;
        @Field("package_details")
        private String packageDetails;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StudentEntry {
        private String name;
        @Field("enrollment_number")
        private String enrollmentNumber;
        private String role;
        @Field("package")
        private BigDecimal packageValue;
    }

    public PlacementRecord toRecord() {
        Map<String, RolePackage> roleMap = new LinkedHashMap<>();
        if (roles != null) {
            for (RoleEntry entry : roles) {
                roleMap.put(entry.getRole(),
                        new RolePackage(entry.getRole(), entry.getPackageValue(), entry.getPackageDetails()));
            }
        }
        Map<String, Student> studentMap = new LinkedHashMap<>();
        if (studentsSelected != null) {
            for (StudentEntry entry : studentsSelected) {
                studentMap.put(entry.getEnrollmentNumber(), new Student(
                        entry.getName(), entry.getEnrollmentNumber(), entry.getRole(), entry.getPackageValue()));
            }
        }
        return new PlacementRecord(id, company, roleMap, studentMap, createdAt, updatedAt, version);
    }

    public static PlacementDocument fromRecord(PlacementRecord record) {
        return PlacementDocument.builder()
                .id(record.id())
                .company(record.company())
                .roles(toRoleEntries(record))
                .studentsSelected(toStudentEntries(record))
                .numberOfOffers(record.numberOfOffers())
                .createdAt(record.createdAt())
                .updatedAt(record.updatedAt())
                .version(record.version())
                .build();
    }

    public static List<RoleEntry> toRoleEntries(PlacementRecord record) {
        return record.roles().values().stream()
                .map(r -> new RoleEntry(r.role(), r.packageValue(), r.packageDetails()))
                .toList();
    }

    public static List<StudentEntry> toStudentEntries(PlacementRecord record) {
        return record.studentsSelected().values().stream()
                .map(s -> new StudentEntry(s.name(), s.enrollmentNumber(), s.role(), s.packageValue()))
                .toList();
    }
}

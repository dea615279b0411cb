package dev.sensai.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A user's resume, one document per {@code user_id} in the {@code resume} collection.
 * Sections are embedded in the document rather than stored in separate collections.
 */
@Document(collection = ResumeProfile.COLLECTION)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeProfile {

    public static final String COLLECTION = "resume";

    @Id
    private String id;

    @Field("user_id")
    private String userId;

    private String email;

    private String linkedin;

    private String twitter;

    private String summary;

    @Builder.Default
    private List<String> skills = new ArrayList<>();

    @Builder.Default
    private List<Experience> experiences = new ArrayList<>();

    @Builder.Default
    private List<Education> education = new ArrayList<>();

    @Builder.Default
    private List<Project> projects = new ArrayList<>();

    @Field("created_at")
    private Instant createdAt;

    @Field("updated_at")
    private Instant updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Experience {
        private String company;
        private String role;
        private String start;
        private String end;
        private String description;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Education {
        private String school;
        private String degree;
        private String start;
        private String end;
        private String details;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Project {
        private String name;
        private String link;
        private String description;
    }
}

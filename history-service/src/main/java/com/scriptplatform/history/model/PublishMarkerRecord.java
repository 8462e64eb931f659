package com.scriptplatform.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Advisory "published" bookkeeping. The newest row per (user, platform) names the
 * snapshot an outcome submission targets when it carries no snapshot id.
 */
@Data
@NoArgsConstructor
@Table("publish_markers")
public class PublishMarkerRecord {

    @Id
    private Long id;

    private String userId;
    private String platform;
    private Long   draftSnapshotId;

    private LocalDateTime markedAt;
}

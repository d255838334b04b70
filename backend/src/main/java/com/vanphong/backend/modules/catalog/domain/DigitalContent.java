package com.vanphong.backend.modules.catalog.domain;

import java.util.UUID;

import com.vanphong.backend.modules.metadata.domain.AbstractMetadataEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Downloadable content attached to a variant (e-vouchers, guides).
 */
@Entity
@Table(name = "digital_content")
public class DigitalContent extends AbstractMetadataEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "variant_id", nullable = false, unique = true)
    private RoomVariant variant;

    @Column(name = "content_url", length = 1024)
    private String contentUrl;

    @Column(name = "max_downloads")
    private Integer maxDownloads;

    @Column(name = "url_valid_days")
    private Integer urlValidDays;

    @Override
    public UUID getId() {
        return id;
    }

    public RoomVariant getVariant() {
        return variant;
    }

    public void setVariant(RoomVariant variant) {
        this.variant = variant;
    }

    public String getContentUrl() {
        return contentUrl;
    }

    public void setContentUrl(String contentUrl) {
        this.contentUrl = contentUrl;
    }

    public Integer getMaxDownloads() {
        return maxDownloads;
    }

    public void setMaxDownloads(Integer maxDownloads) {
        this.maxDownloads = maxDownloads;
    }

    public Integer getUrlValidDays() {
        return urlValidDays;
    }

    public void setUrlValidDays(Integer urlValidDays) {
        this.urlValidDays = urlValidDays;
    }
}

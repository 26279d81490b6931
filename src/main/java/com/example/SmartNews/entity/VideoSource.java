package com.example.SmartNews.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A news channel the service downloads from, as listed in sources.json.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VideoSource {
    private String id;
    private String name;
    private String description = "";
    private String url = "";

    @JsonProperty("channel_id")
    private String channelId;

    private String category = "general";
    private String language = "en";
    private String difficulty = "intermediate";

    @JsonProperty("typical_duration")
    private String typicalDuration = "varies";

    @JsonProperty("update_frequency")
    private String updateFrequency = "varies";

    @JsonProperty("subtitle_available")
    private boolean subtitleAvailable = true;

    private boolean enabled = true;
    private List<String> tags = new ArrayList<>();
    private Map<String, String> playlists;
}

package com.github.stormino.medialib.controller;

import com.github.stormino.medialib.service.storage.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("VideoController")
class VideoControllerTest {

    @TempDir
    Path tempDir;

    private ArtifactStore artifactStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        artifactStore = mock(ArtifactStore.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new VideoController(artifactStore)).build();
    }

    @Test
    @DisplayName("should redirect to remote storage when it holds the file")
    void shouldRedirectToRemote() throws Exception {
        when(artifactStore.urlFor("a.mp4")).thenReturn(Optional.of("https://bucket.example/a.mp4?sig=1"));

        mockMvc.perform(get("/videos/a.mp4"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "https://bucket.example/a.mp4?sig=1"));
    }

    @Test
    @DisplayName("should stream the local file otherwise")
    void shouldServeLocalFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.mp4"), "bytes");
        when(artifactStore.urlFor("a.mp4")).thenReturn(Optional.empty());
        when(artifactStore.localPath("a.mp4")).thenReturn(Optional.of(file));

        mockMvc.perform(get("/videos/a.mp4"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("video/mp4"))
                .andExpect(content().string("bytes"));
    }

    @Test
    @DisplayName("should answer 404 for unknown or unsafe names")
    void shouldRejectUnknown() throws Exception {
        when(artifactStore.urlFor("missing.mp4")).thenReturn(Optional.empty());
        when(artifactStore.localPath("missing.mp4")).thenReturn(Optional.empty());

        mockMvc.perform(get("/videos/missing.mp4")).andExpect(status().isNotFound());
        mockMvc.perform(get("/videos/.hidden")).andExpect(status().isNotFound());
    }
}

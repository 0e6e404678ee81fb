package com.phillippitts.videoconverter.service.transcode;

import com.phillippitts.videoconverter.domain.WatchedPath;
import com.phillippitts.videoconverter.testutil.TestSettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DestinationResolverTest {

    private final WatchedPath watched = TestSettings.watched(Path.of("/media/in"), Path.of("/media/converted"));

    @Test
    void relativePathIsKeptAndExtensionReplaced() {
        DestinationResolver resolver = new DestinationResolver("mp4");

        assertThat(resolver.resolve(Path.of("/media/in/show/s01/e01.mkv"), watched))
                .isEqualTo(Path.of("/media/converted/show/s01/e01.mp4"));
    }

    @Test
    void dotsInTheBaseNameSurvive() {
        DestinationResolver resolver = new DestinationResolver(".mkv");

        assertThat(resolver.resolve(Path.of("/media/in/Movie.2021.1080p.avi"), watched))
                .isEqualTo(Path.of("/media/converted/Movie.2021.1080p.mkv"));
    }

    @Test
    void partialPathAddsSuffix() {
        assertThat(DestinationResolver.partialPath(Path.of("/media/converted/a.mp4")))
                .isEqualTo(Path.of("/media/converted/a.mp4.part"));
    }

    @Test
    void alternativesTagTheSourceExtensionThenCount() {
        DestinationResolver resolver = new DestinationResolver("mp4");
        Path source = Path.of("/media/in/show/movie.avi");

        assertThat(resolver.alternative(source, watched, 0)).isEqualTo(Path.of("/media/converted/show/movie.mp4"));
        assertThat(resolver.alternative(source, watched, 1)).isEqualTo(Path.of("/media/converted/show/movie-avi.mp4"));
        assertThat(resolver.alternative(source, watched, 2)).isEqualTo(Path.of("/media/converted/show/movie-avi-2.mp4"));
        assertThat(resolver.alternative(Path.of("/media/in/clip"), watched, 1))
                .isEqualTo(Path.of("/media/converted/clip-1.mp4"));
    }
}

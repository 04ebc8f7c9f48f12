package com.example.musiccurator.application.job;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.musiccurator.application.service.LibraryIndexService;
import com.example.musiccurator.common.config.AppLibraryProperties;
import com.example.musiccurator.common.exception.BusinessException;
import com.example.musiccurator.domain.model.IndexResult;
import com.example.musiccurator.domain.model.VerifyResult;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ScheduledIndexJobTest {

    @Test
    void noRootsShouldSkipRun() {
        LibraryIndexService indexService = mock(LibraryIndexService.class);

        new ScheduledIndexJob(new AppLibraryProperties(), indexService).run();

        verify(indexService, never()).index(anyString(), anyBoolean(), anyBoolean());
    }

    @Test
    void failingRootShouldNotStopRemainingRoots() {
        LibraryIndexService indexService = mock(LibraryIndexService.class);
        AppLibraryProperties properties = new AppLibraryProperties();
        properties.setScheduledRoots(Arrays.asList("/missing", "/music"));
        when(indexService.index("/missing", false, true)).thenThrow(new BusinessException("404", "gone"));
        when(indexService.index("/music", false, true)).thenReturn(new IndexResult());
        when(indexService.verify("/music")).thenReturn(new VerifyResult(3, 0, 0));

        new ScheduledIndexJob(properties, indexService).run();

        verify(indexService).index("/music", false, true);
        verify(indexService).verify("/music");
        verify(indexService, never()).verify("/missing");
    }
}

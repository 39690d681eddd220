package com.xksgroup.hlstranscoder.service;

import com.xksgroup.hlstranscoder.config.TranscodeProperties;
import com.xksgroup.hlstranscoder.exception.InvalidProfileException;
import com.xksgroup.hlstranscoder.exception.NotFoundException;
import com.xksgroup.hlstranscoder.exception.QueueUnavailableException;
import com.xksgroup.hlstranscoder.model.Job.Job;
import com.xksgroup.hlstranscoder.model.Job.JobStatus;
import com.xksgroup.hlstranscoder.model.Rendition;
import com.xksgroup.hlstranscoder.model.RenditionStatus;
import com.xksgroup.hlstranscoder.model.Video;
import com.xksgroup.hlstranscoder.model.dto.JobDescriptor;
import com.xksgroup.hlstranscoder.service.helper.ProfileLadder;
import com.xksgroup.hlstranscoder.service.queue.Delivery;
import com.xksgroup.hlstranscoder.service.queue.InMemoryWorkQueue;
import com.xksgroup.hlstranscoder.service.queue.WorkQueue;
import com.xksgroup.hlstranscoder.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class JobProducerTest {

    private TestDatabase db;
    private InMemoryWorkQueue queue;
    private TranscodeProperties properties;
    private JobProducer producer;

    @BeforeEach
    void setUp() {
        db = new TestDatabase();
        db.insertVideo("v1");
        queue = new InMemoryWorkQueue();
        properties = new TranscodeProperties();
        producer = producerWith(queue);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private JobProducer producerWith(WorkQueue workQueue) {
        return new JobProducer(db.videos, db.jobs, db.renditions, workQueue,
                new ProfileLadder(properties), properties, db.transactionTemplate);
    }

    @Test
    void submitRecordsJobAndRenditionsThenEnqueuesOnce() throws InterruptedException {
        Job job = producer.submit("v1", List.of(240, 720));

        assertThat(db.jobs.findById(job.getId()).orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);
        List<Rendition> renditions = db.renditions.findByJobId(job.getId());
        assertThat(renditions).extracting(Rendition::getHeight).containsExactly(240, 720);
        assertThat(renditions).extracting(Rendition::getStatus).containsOnly(RenditionStatus.QUEUED);
        assertThat(renditions).extracting(Rendition::getBitrateKbps).containsExactly(400, 1500);

        assertThat(queue.size()).isEqualTo(1);
        Delivery delivery = queue.poll(Duration.ZERO).orElseThrow();
        assertThat(delivery.descriptor())
                .isEqualTo(new JobDescriptor(job.getId(), "v1", List.of(240, 720)));
    }

    @Test
    void missingProfilesUseConfiguredDefaultLadder() {
        properties.setDefaultLadder(List.of(360, 1080));
        producer = producerWith(queue);

        Job job = producer.submit("v1", null);

        assertThat(job.getProfiles()).containsExactly(360, 1080);
        assertThat(db.renditions.findByJobId(job.getId())).hasSize(2);
    }

    @Test
    void emptyProfilesUseDefaultLadder() {
        Job job = producer.submit("v1", List.of());

        assertThat(job.getProfiles()).containsExactly(240, 480, 720);
    }

    @Test
    void duplicateHeightsCollapseKeepingFirstOccurrence() {
        Job job = producer.submit("v1", Arrays.asList(720, 240, 720));

        assertThat(job.getProfiles()).containsExactly(720, 240);
        assertThat(db.renditions.findByJobId(job.getId())).hasSize(2);
    }

    @Test
    void unknownVideoWritesAndEnqueuesNothing() {
        assertThatThrownBy(() -> producer.submit("ghost", List.of(240)))
                .isInstanceOf(NotFoundException.class);

        assertThat(db.count("jobs")).isZero();
        assertThat(db.count("renditions")).isZero();
        assertThat(queue.size()).isZero();
    }

    @Test
    void unsupportedHeightWritesAndEnqueuesNothing() {
        assertThatThrownBy(() -> producer.submit("v1", List.of(240, 1440)))
                .isInstanceOfSatisfying(InvalidProfileException.class, e -> assertThat(e.getHeight()).isEqualTo(1440));

        assertThat(db.count("jobs")).isZero();
        assertThat(queue.size()).isZero();
    }

    @Test
    void enqueueFailureFailsTheJob() {
        WorkQueue broken = mock(WorkQueue.class);
        doThrow(new QueueUnavailableException("redis down", null)).when(broken).push(any());
        producer = producerWith(broken);

        assertThatThrownBy(() -> producer.submit("v1", List.of(240)))
                .isInstanceOf(QueueUnavailableException.class);

        Job job = db.jdbcTemplate.queryForList("SELECT id FROM jobs", String.class).stream()
                .map(id -> db.jobs.findById(id).orElseThrow())
                .findFirst().orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).contains("redis down");
        assertThat(db.renditions.findByJobId(job.getId()))
                .extracting(Rendition::getStatus).containsOnly(RenditionStatus.FAILED);
    }

    @Test
    void registerVideoDerivesSourceKey() {
        Video video = producer.registerVideo("My Clip.MOV");

        assertThat(video.getSourceKey()).isEqualTo("source/" + video.getId() + ".mov");
        assertThat(db.videos.findById(video.getId())).isPresent();
    }
}

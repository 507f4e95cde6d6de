package com.grademax.pipeline;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class PipelineApiTest {
    @Autowired
    private MockMvc mockMvc;

    @Test
    void uploadsPaperAndListsItsUnits() throws Exception {
        ExamPdfFixtures.PaperFixture fixture = ExamPdfFixtures.physicsPaper(8, 17, 4);
        MockMultipartFile questionPaper = new MockMultipartFile("questionPaper", "4PH1_1P_Jun_2048.pdf",
                MediaType.APPLICATION_PDF_VALUE, fixture.questionPaper());
        MockMultipartFile markScheme = new MockMultipartFile("markScheme", "4PH1_1P_MS_Jun_2048.pdf",
                MediaType.APPLICATION_PDF_VALUE, fixture.markScheme());

        mockMvc.perform(multipart("/api/papers").file(questionPaper).file(markScheme))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.paper.totalQuestions").value(8))
                .andExpect(jsonPath("$.paper.metadata.year").value(2048));

        mockMvc.perform(get("/api/units").param("yearFrom", "2048").param("yearTo", "2048")
                        .param("wholeQuestionsOnly", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(8));
    }

    @Test
    void uploadWithoutUsableMetadataIsABadRequest() throws Exception {
        MockMultipartFile questionPaper = new MockMultipartFile("questionPaper", "scan.pdf",
                MediaType.APPLICATION_PDF_VALUE, ExamPdfFixtures.physicsPaper(8, 17, 0).questionPaper());

        mockMvc.perform(multipart("/api/papers").file(questionPaper))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void mapsErrorsToStatusCodes() throws Exception {
        mockMvc.perform(get("/api/worksheets/missing-id"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));

        mockMvc.perform(get("/api/units").param("yearFrom", "2020").param("yearTo", "2019"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/units").param("difficulty", "brutal"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/worksheets").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"topicCodes\": [\"1\"], \"maxCount\": 0}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/papers/no-such-paper/relink"))
                .andExpect(status().isNotFound());
    }
}

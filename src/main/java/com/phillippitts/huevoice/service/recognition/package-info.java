/**
 * Remote speech recognition and the confidence/duplicate gate that turns transcripts into commands.
 */
package com.phillippitts.huevoice.service.recognition;

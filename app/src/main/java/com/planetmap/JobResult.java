package com.planetmap;

/**
 * Terminal outcome of a worker job. Exactly one is delivered per job.
 */
public sealed interface JobResult
{
	JobResult CANCELLED = new Cancelled();

	/** Carries the disk found by a load job, or the disk a projection was computed for. */
	record Success(DiskInfo diskInfo) implements JobResult {}

	record Failed(String message) implements JobResult {}

	record Cancelled() implements JobResult {}
}

package com.questrail.transferd.daemon;

import com.questrail.transferd.api.Arguments;
import com.questrail.transferd.api.AuthLevel;
import com.questrail.transferd.api.CallContext;
import com.questrail.transferd.engine.JobCommand;
import com.questrail.transferd.engine.JobEngine;
import com.questrail.transferd.engine.JobEngineException;
import com.questrail.transferd.rpc.OperationRecord;

import java.util.List;
import java.util.Objects;

/**
 * Built-in {@code job.*} operations, each a thin translation of the call's
 * arguments into one {@link JobCommand}.
 */
public final class JobOperations
{
    private final JobEngine engine;

    public JobOperations(JobEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public List<OperationRecord> operations() {
        return List.of(
                OperationRecord.builtIn("job.add", AuthLevel.NORMAL, this::add),
                OperationRecord.builtIn("job.remove", AuthLevel.ADMIN, this::remove),
                OperationRecord.builtIn("job.pause", AuthLevel.NORMAL, this::pause),
                OperationRecord.builtIn("job.resume", AuthLevel.NORMAL, this::resume),
                OperationRecord.builtIn("job.status", AuthLevel.READ_ONLY, this::status),
                OperationRecord.builtIn("job.list", AuthLevel.READ_ONLY, this::list));
    }

    Object add(CallContext context, Arguments args) throws JobEngineException {
        return engine.execute(new JobCommand.Add(args.requireString(0, "source"), args.optionalMap(1, "options")));
    }

    Object remove(CallContext context, Arguments args) throws JobEngineException {
        return engine.execute(new JobCommand.Remove(args.requireString(0, "job_id"),
                args.optionalBoolean(1, "remove_data", false)));
    }

    Object pause(CallContext context, Arguments args) throws JobEngineException {
        return engine.execute(new JobCommand.Pause(args.requireString(0, "job_id")));
    }

    Object resume(CallContext context, Arguments args) throws JobEngineException {
        return engine.execute(new JobCommand.Resume(args.requireString(0, "job_id")));
    }

    Object status(CallContext context, Arguments args) throws JobEngineException {
        return engine.execute(new JobCommand.Status(args.requireString(0, "job_id")));
    }

    Object list(CallContext context, Arguments args) throws JobEngineException {
        return engine.execute(new JobCommand.ListAll());
    }
}
